package io.vais.lang;

public enum Severity {
    ERROR, WARNING, INFO
}
