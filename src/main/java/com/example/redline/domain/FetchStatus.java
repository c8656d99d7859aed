package com.example.redline.domain;

public enum FetchStatus {
    UNFETCHED,
    FETCHED,
    FAILED
}
