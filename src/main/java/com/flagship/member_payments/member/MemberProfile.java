package com.flagship.member_payments.member;

import lombok.Value;

import java.util.UUID;

/**
 * Identity and billing details of a member, as owned by the identity service.
 */
@Value
public class MemberProfile {
    UUID id;
    String fullName;
    String email;
    String phone;
    String pan;
    String address;
    String stateCode;
}
