package com.dcruver.kepwaretags.domain;

public class InvalidNameException extends HierarchyException {

    public InvalidNameException(String message) {
        super(message);
    }
}
