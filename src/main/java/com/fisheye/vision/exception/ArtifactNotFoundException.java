package com.fisheye.vision.exception;

/**
 * 存储中不存在引用的对象
 */
public class ArtifactNotFoundException extends PipelineException {
    private final String location;

    public ArtifactNotFoundException(String location) {
        super("Artifact not found: " + location);
        this.location = location;
    }

    public ArtifactNotFoundException(String location, Throwable cause) {
        super("Artifact not found: " + location, cause);
        this.location = location;
    }

    public String getLocation() { return location; }

    @Override
    public String getErrorType() {
        return "not_found";
    }
}
