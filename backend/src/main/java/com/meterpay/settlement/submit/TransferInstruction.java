package com.meterpay.settlement.submit;

/**
 * Unsigned native transfer handed to the payer's signer.
 */
public record TransferInstruction(String payerAddress,
                                  String recipientAddress,
                                  long lamports,
                                  String recentBlockhash) {
}
