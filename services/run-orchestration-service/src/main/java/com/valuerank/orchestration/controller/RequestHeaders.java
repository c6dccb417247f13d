package com.valuerank.orchestration.controller;

final class RequestHeaders {

    static final String USER_ID = "X-User-Id";

    private RequestHeaders() {
    }
}
