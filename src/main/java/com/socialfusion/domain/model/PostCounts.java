package com.socialfusion.domain.model;

public record PostCounts(int likes, int reposts, int replies) {

    public static final PostCounts ZERO = new PostCounts(0, 0, 0);
}
