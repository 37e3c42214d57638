package com.pinwatch.governance.domain;

public enum ScanFailureCode {
    NOT_FOUND,
    FETCH_ERROR,
    PARSE_ERROR
}
