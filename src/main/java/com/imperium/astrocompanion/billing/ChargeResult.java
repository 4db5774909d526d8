package com.imperium.astrocompanion.billing;

public enum ChargeResult {
    APPROVED,
    DENIED
}
