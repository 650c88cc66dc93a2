package com.smarttodo.exception;

/**
 * The requested entity does not exist for the calling user.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String type, Object id) {
        super(type + " not found: " + id);
    }
}
