package io.intellixity.frugal.access.query;

public enum Clause { AND, OR }
