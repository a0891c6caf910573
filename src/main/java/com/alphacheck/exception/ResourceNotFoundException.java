package com.alphacheck.exception;

import java.nio.file.Path;
import java.util.Map;

/** An input location named by the request, such as a data directory, does not exist. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resource, Path location) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s not found: %s", resource, location),
                Map.of("resource", resource, "location", location.toString()));
    }
}
