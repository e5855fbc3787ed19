package com.whereq.governor.exception;

public class UnknownAssetException extends GovernorException {
    public UnknownAssetException(String assetId) {
        super("Asset not registered: " + assetId);
    }
}
