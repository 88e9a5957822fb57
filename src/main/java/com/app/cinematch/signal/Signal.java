package com.app.cinematch.signal;

public enum Signal {
    INTEREST,
    DISCOVERY,
    COLLABORATIVE,
    CATEGORY
}
