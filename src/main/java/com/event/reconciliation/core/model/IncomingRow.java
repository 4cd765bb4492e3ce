package com.event.reconciliation.core.model;

/**
 * One raw row from the intake feed. Every field is the loosely formatted string the feed
 * supplied ({@code "10/15/2025"}, {@code "(555) 123-4567"}, ...); nothing is validated here.
 *
 * @param externalRowId    the feed's row identifier (sheet row number), used for Tier-1 linkage
 * @param externalId       the feed's stable external id, may be blank
 * @param organizationName requesting organization
 * @param contactName      full contact name, split into first/last during normalization
 * @param email            contact email
 * @param phone            contact phone
 * @param department       department or sub-group within the organization
 * @param desiredEventDate requested event date as a locale date string or spreadsheet serial
 * @param submittedAt      submission timestamp as a locale date-time string or spreadsheet serial
 * @param status           status column of the feed, may be blank
 * @param message          free-text message from the requester
 * @param previouslyHosted whether the organization hosted before
 * @param notes            free-text notes column
 */
public record IncomingRow(
        String externalRowId,
        String externalId,
        String organizationName,
        String contactName,
        String email,
        String phone,
        String department,
        String desiredEventDate,
        String submittedAt,
        String status,
        String message,
        String previouslyHosted,
        String notes
) {

    /**
     * Returns a copy of this row carrying the given external id.
     */
    public IncomingRow withExternalId(String newExternalId) {
        return new IncomingRow(externalRowId, newExternalId, organizationName, contactName, email, phone,
                department, desiredEventDate, submittedAt, status, message, previouslyHosted, notes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String externalRowId;
        private String externalId;
        private String organizationName;
        private String contactName;
        private String email;
        private String phone;
        private String department;
        private String desiredEventDate;
        private String submittedAt;
        private String status;
        private String message;
        private String previouslyHosted;
        private String notes;

        public Builder externalRowId(String externalRowId) {
            this.externalRowId = externalRowId;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder organizationName(String organizationName) {
            this.organizationName = organizationName;
            return this;
        }

        public Builder contactName(String contactName) {
            this.contactName = contactName;
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

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder desiredEventDate(String desiredEventDate) {
            this.desiredEventDate = desiredEventDate;
            return this;
        }

        public Builder submittedAt(String submittedAt) {
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

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public IncomingRow build() {
            return new IncomingRow(externalRowId, externalId, organizationName, contactName, email, phone,
                    department, desiredEventDate, submittedAt, status, message, previouslyHosted, notes);
        }
    }
}
