package com.xingest.core.build;

import com.xingest.core.model.PostRecord;
import com.xingest.core.model.ProfileRecord;

import java.util.List;

/** RecordBuilder 산출물. 에러 목록 순서: 프로필 → 포스트 → 추출 단계. */
public final class BuildOutcome {
    private final ProfileRecord profile;   // nullable
    private final List<PostRecord> posts;
    private final List<String> errors;
    private final boolean profileFailed;

    BuildOutcome(ProfileRecord profile, List<PostRecord> posts, List<String> errors, boolean profileFailed) {
        this.profile = profile;
        this.posts = List.copyOf(posts);
        this.errors = List.copyOf(errors);
        this.profileFailed = profileFailed;
    }

    public ProfileRecord getProfile() { return profile; }
    public List<PostRecord> getPosts() { return posts; }
    public List<String> getErrors() { return errors; }
    public boolean isProfileFailed() { return profileFailed; }

    /** 포스트 단위 실패만으로는 false 가 되지 않는다 */
    public boolean isSuccess() { return !profileFailed && profile != null; }

    /** "; " 로 합친 에러. 없으면 null */
    public String errorMessage() {
        return errors.isEmpty() ? null : String.join("; ", errors);
    }
}
