package com.boardrag.pipeline.infra;

public record ObjectStat(String key, long size, String contentType) {}
