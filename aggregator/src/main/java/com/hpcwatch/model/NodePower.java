package com.hpcwatch.model;

public record NodePower(String node, long watts) {
}
