package com.cloud.emulator.service.ec2;

public record Subnet(String subnetId, String vpcId, String cidrBlock, boolean defaultForAz) {
}
