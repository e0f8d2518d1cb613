package io.meshroute.router.scale;

/**
 * A provisioning or deprovisioning call failed.
 */
public class ScaleActionFailedException extends RuntimeException {

    public ScaleActionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
