package com.tradecore.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    ILLEGAL_STATE("ILLEGAL_STATE"),
    GATEWAY_ERROR("GATEWAY_ERROR");

    private final String code;
}
