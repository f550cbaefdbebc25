package com.xingest.core.model;

import java.util.List;
import java.util.Objects;

/** 추출 단계 산출물(타입 미적용). 페치마다 새로 만들어지며 직접 저장되지 않는다. */
public final class ExtractionOutcome {
    private final RawFields profile;
    private final List<RawFields> posts;
    private final List<String> errors;

    public ExtractionOutcome(RawFields profile, List<RawFields> posts, List<String> errors) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.posts = List.copyOf(posts);
        this.errors = List.copyOf(errors);
    }

    public RawFields getProfile() { return profile; }
    public List<RawFields> getPosts() { return posts; }
    public List<String> getErrors() { return errors; }
}
