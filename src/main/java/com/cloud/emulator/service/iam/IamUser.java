package com.cloud.emulator.service.iam;

public record IamUser(String userName, String userId, String arn, String createDate) {
}
