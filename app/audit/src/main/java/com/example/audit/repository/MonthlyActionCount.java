package com.example.audit.repository;

/** Count of one action within one calendar month, {@code yearMonth} formatted as yyyy-MM. */
public record MonthlyActionCount(String yearMonth, String action, long count) {}
