package com.example.collectfaster;

public enum TransferOperation {
    COPY,
    LINK
}
