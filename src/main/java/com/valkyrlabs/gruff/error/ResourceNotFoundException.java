package com.valkyrlabs.gruff.error;

public class ResourceNotFoundException extends GruffException {

    private static final long serialVersionUID = 7723410293847561L;

    public ResourceNotFoundException(String code, String message) {
        super(code, message);
    }
}
