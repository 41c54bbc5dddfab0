package com.cloud.emulator.service.ec2;

public record SecurityGroup(String groupId, String groupName, String description, String vpcId) {

    public static final String DEFAULT_GROUP_NAME = "default";
}
