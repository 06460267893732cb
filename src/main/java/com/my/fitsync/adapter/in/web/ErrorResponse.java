package com.my.fitsync.adapter.in.web;

public record ErrorResponse(String error, String message) {
}
