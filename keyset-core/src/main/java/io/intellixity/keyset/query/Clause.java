package io.intellixity.keyset.query;

public enum Clause { AND, OR }
