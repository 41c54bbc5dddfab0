package com.cloud.emulator.service.iam;

public record InstanceProfile(String instanceProfileName, String instanceProfileId, String arn,
                              String createDate) {
}
