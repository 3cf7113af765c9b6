package com.cine.explorer.model.dto;

public record DirectorCollaboration(String director, long movies) {
}
