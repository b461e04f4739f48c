package com.meterpay.settlement.submit;

/**
 * Payer-side signing (wallet). Signing keys never reach this service.
 */
@FunctionalInterface
public interface TransferSigner {

    /**
     * Builds and signs the transfer, returning the serialized transaction as base64.
     *
     * @throws TransferRejectedException when the payer declines
     */
    String sign(TransferInstruction instruction);
}
