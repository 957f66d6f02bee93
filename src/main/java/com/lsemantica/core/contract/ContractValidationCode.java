package com.lsemantica.core.contract;

public enum ContractValidationCode {
    INVALID_INPUT,
    VERSION_INCOMPATIBLE,
    SCHEMA_VALIDATION_FAILED
}
