/*
 * Where: Audit admin API
 * What: Standard error body
 * Why: Every failure reaches the client in the same shape
 */
package com.example.audit.api;

public record ApiErrorResponse(String code, String message) {}
