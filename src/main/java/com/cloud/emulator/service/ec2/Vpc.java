package com.cloud.emulator.service.ec2;

public record Vpc(String vpcId, String cidrBlock, boolean defaultVpc) {
}
