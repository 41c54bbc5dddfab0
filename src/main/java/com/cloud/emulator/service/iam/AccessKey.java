package com.cloud.emulator.service.iam;

/**
 * Access key record. The secret is only returned by the create call.
 */
public record AccessKey(String accessKeyId, String userName, String secretAccessKey, String status,
                        String createDate) {

    public static final String ACTIVE = "Active";
}
