package io.trading.adapter.binance.common;

/**
 * Error reported by the venue's HTTP API.
 */
public class BinanceApiException extends RuntimeException {

    private final int status;
    private final long code;

    /**
     * @param status  HTTP status code
     * @param code    venue error code (e.g., -1121 for an invalid symbol)
     * @param message venue error message
     */
    public BinanceApiException(int status, long code, String message) {
        super(String.format("Binance API error (status=%d, code=%d): %s", status, code, message));
        this.status = status;
        this.code = code;
    }

    public int getStatus() {
        return status;
    }

    public long getCode() {
        return code;
    }
}
