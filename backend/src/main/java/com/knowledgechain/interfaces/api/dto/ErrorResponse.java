package com.knowledgechain.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
