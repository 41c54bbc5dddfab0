package com.cloud.emulator.service.iam;

public record IamGroup(String groupName, String groupId, String arn, String createDate) {
}
