package com.blanklines.api;

import java.util.ArrayList;
import java.util.List;

import com.blanklines.api.error.CheckerError;

/**
 * Result of checking one source file.
 */
public class CheckResult {
    private final boolean successful;
    private final List<CheckerError> errors;

    private CheckResult(Builder builder) {
        this.successful = builder.successful;
        this.errors = builder.errors;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public List<CheckerError> getErrors() {
        return errors;
    }

    public boolean hasFindings() {
        return !errors.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private List<CheckerError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder addError(CheckerError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<CheckerError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public CheckResult build() {
            return new CheckResult(this);
        }
    }
}
