package org.nowstart.walkforward.data.type;

public enum FailureCode {
    INVALID_CONFIGURATION,
    NO_VALID_COMBINATION,
    NO_WINDOWS,
    NO_SUCCESSFUL_WINDOW
}
