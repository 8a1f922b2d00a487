package com.survivaladvisor.common.model;

public enum AnswerSource {
    RULES,
    AI,
    ERROR
}
