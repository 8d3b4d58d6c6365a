package com.vedant.sqlgateway.service;

public record ColumnInfo(String name, String type) {}
