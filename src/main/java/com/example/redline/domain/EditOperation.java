package com.example.redline.domain;

public enum EditOperation {
    UNCHANGED,
    DELETED,
    INSERTED
}
