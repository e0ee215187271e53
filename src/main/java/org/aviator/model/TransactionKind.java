package org.aviator.model;

public enum TransactionKind {
    BET, WIN
}
