package com.vedant.sqlgateway.dto;

import java.util.List;

public class ValidationResponseDTO {
    private boolean valid;
    private List<String> errors;
    private List<String> errorKinds;
    private List<String> warnings;
    private List<String> tables;
    private boolean requiresTenantFilter;

    public ValidationResponseDTO() {}

    public boolean isValid() { return valid; }
    public void setValid(boolean valid) { this.valid = valid; }

    public List<String> getErrors() { return errors; }
    public void setErrors(List<String> errors) { this.errors = errors; }

    public List<String> getErrorKinds() { return errorKinds; }
    public void setErrorKinds(List<String> errorKinds) { this.errorKinds = errorKinds; }

    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }

    public List<String> getTables() { return tables; }
    public void setTables(List<String> tables) { this.tables = tables; }

    public boolean isRequiresTenantFilter() { return requiresTenantFilter; }
    public void setRequiresTenantFilter(boolean requiresTenantFilter) { this.requiresTenantFilter = requiresTenantFilter; }
}
