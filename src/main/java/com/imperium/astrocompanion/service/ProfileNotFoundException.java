package com.imperium.astrocompanion.service;

public class ProfileNotFoundException extends RuntimeException {

    private final String userId;

    public ProfileNotFoundException(String userId) {
        super("Profile not found: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
