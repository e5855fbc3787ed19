package com.whereq.governor.exception;

public class InvalidSizeException extends GovernorException {
    public InvalidSizeException(String assetId, double sizeMb) {
        super("Asset " + assetId + " has invalid size " + sizeMb + " MB (must be a finite value >= 0)");
    }
}
