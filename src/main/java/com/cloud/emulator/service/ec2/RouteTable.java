package com.cloud.emulator.service.ec2;

/**
 * Route table record. Every VPC gets one main route table, deleted together with the VPC.
 */
public record RouteTable(String routeTableId, String vpcId, boolean main) {
}
