package com.event.reconciliation.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted event request as seen by the reconciliation engine.
 * Instances are immutable; the sync orchestrator produces updated copies through {@link #toBuilder()}.
 *
 * <p>A builder without an id assigns a random UUID.
 * {@code desiredEventDate} identifies which event the request is about. It is nullable:
 * a record without an event date never takes part in date-gated matching.</p>
 */
public final class ExistingEventRequest {
    private final String id;
    private final String externalRowId;
    private final String externalId;
    private final String email;
    private final String phone;
    private final String firstName;
    private final String lastName;
    private final String organizationName;
    private final String department;
    private final LocalDate desiredEventDate;
    private final Instant submittedAt;
    private final String status;
    private final String message;
    private final String previouslyHosted;
    private final String duplicateNotes;
    private final String createdBy;
    private final Instant lastSyncedAt;
    private final Instant updatedAt;

    private ExistingEventRequest(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.externalRowId = builder.externalRowId;
        this.externalId = builder.externalId;
        this.email = builder.email;
        this.phone = builder.phone;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.organizationName = builder.organizationName;
        this.department = builder.department;
        this.desiredEventDate = builder.desiredEventDate;
        this.submittedAt = builder.submittedAt;
        this.status = builder.status != null ? builder.status : "new";
        this.message = builder.message;
        this.previouslyHosted = builder.previouslyHosted;
        this.duplicateNotes = builder.duplicateNotes;
        this.createdBy = builder.createdBy;
        this.lastSyncedAt = builder.lastSyncedAt;
        this.updatedAt = builder.updatedAt;
    }

    public String getId() {
        return id;
    }

    public String getExternalRowId() {
        return externalRowId;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getOrganizationName() {
        return organizationName;
    }

    public String getDepartment() {
        return department;
    }

    public LocalDate getDesiredEventDate() {
        return desiredEventDate;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public String getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public String getPreviouslyHosted() {
        return previouslyHosted;
    }

    public String getDuplicateNotes() {
        return duplicateNotes;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getLastSyncedAt() {
        return lastSyncedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .externalRowId(externalRowId)
                .externalId(externalId)
                .email(email)
                .phone(phone)
                .firstName(firstName)
                .lastName(lastName)
                .organizationName(organizationName)
                .department(department)
                .desiredEventDate(desiredEventDate)
                .submittedAt(submittedAt)
                .status(status)
                .message(message)
                .previouslyHosted(previouslyHosted)
                .duplicateNotes(duplicateNotes)
                .createdBy(createdBy)
                .lastSyncedAt(lastSyncedAt)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExistingEventRequest that = (ExistingEventRequest) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ExistingEventRequest{" +
                "id='" + id + '\'' +
                ", externalRowId='" + externalRowId + '\'' +
                ", organizationName='" + organizationName + '\'' +
                ", desiredEventDate=" + desiredEventDate +
                ", status='" + status + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String externalRowId;
        private String externalId;
        private String email;
        private String phone;
        private String firstName;
        private String lastName;
        private String organizationName;
        private String department;
        private LocalDate desiredEventDate;
        private Instant submittedAt;
        private String status;
        private String message;
        private String previouslyHosted;
        private String duplicateNotes;
        private String createdBy;
        private Instant lastSyncedAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder externalRowId(String externalRowId) {
            this.externalRowId = externalRowId;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder organizationName(String organizationName) {
            this.organizationName = organizationName;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder desiredEventDate(LocalDate desiredEventDate) {
            this.desiredEventDate = desiredEventDate;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder previouslyHosted(String previouslyHosted) {
            this.previouslyHosted = previouslyHosted;
            return this;
        }

        public Builder duplicateNotes(String duplicateNotes) {
            this.duplicateNotes = duplicateNotes;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder lastSyncedAt(Instant lastSyncedAt) {
            this.lastSyncedAt = lastSyncedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ExistingEventRequest build() {
            return new ExistingEventRequest(this);
        }
    }
}
