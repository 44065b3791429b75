package com.mikov.emailverifier.smtp.dns;

public record MxRecord(String hostname, int priority) { }
