package net.imagetools.exception;

/**
 * Unknown image, session, history sequence or compression profile.
 * RETRYABLE: No
 */
public class NotFoundException extends ImageToolsException {

    public enum ResourceType {
        IMAGE,
        SESSION,
        SEQUENCE,
        PROFILE
    }

    private final ResourceType resourceType;
    private final String resourceId;

    public NotFoundException(ResourceType resourceType, String resourceId, String message) {
        super(message, false);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public NotFoundException(ResourceType resourceType, String resourceId) {
        this(resourceType, resourceId, resourceType.name().toLowerCase() + " " + resourceId + " not found");
    }

    public static NotFoundException image(String imageId) {
        return new NotFoundException(ResourceType.IMAGE, imageId);
    }

    public static NotFoundException session(String sessionId) {
        return new NotFoundException(ResourceType.SESSION, sessionId);
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
