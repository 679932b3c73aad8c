package com.tradecore.exception;

/**
 * Raised by an {@link com.tradecore.oms.OrderGateway} when the venue rejects a request
 * or cannot be reached. The OrderCoordinator turns it into a failed submission.
 */
public class GatewayException extends BaseException {

    public GatewayException(String message) {
        super(ErrorCode.GATEWAY_ERROR, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, cause);
    }
}
