package com.cine.explorer.model.dto;

public record PersonRow(String personId, String name) {
}
