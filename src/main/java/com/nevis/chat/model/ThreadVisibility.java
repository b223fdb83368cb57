package com.nevis.chat.model;

public enum ThreadVisibility {
    ORG,
    PRIVATE
}
