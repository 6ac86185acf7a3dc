package com.eainde.manuscript.state;

public enum CriticStatus {
    PASS,
    FAIL,
    UNKNOWN
}
