package com.flagship.member_payments.document;

import lombok.Value;

/**
 * What a generator produced: the artifact's number and where it is stored.
 */
@Value
public class GenerationResult {
    String documentNumber;
    String documentUrl;
}
