package com.xingest.core.extract;

/** DOM 셀렉터 모음. 마크업이 바뀌면 여기만 고친다. */
public final class Selectors {
    private Selectors() {}

    public static final String PRIMARY_COLUMN = "[data-testid=primaryColumn]";

    // 프로필
    public static final String USER_NAME = "[data-testid=UserName]";
    public static final String USER_DESCRIPTION = "[data-testid=UserDescription]";
    public static final String USER_JOIN_DATE = "[data-testid=UserJoinDate]";
    public static final String USER_URL = "[data-testid=UserUrl]";
    public static final String USER_LOCATION = "[data-testid=UserLocation]";
    public static final String FOLLOWERS_LINK = "a[href$=/verified_followers]";
    public static final String FOLLOWERS_LINK_FALLBACK = "a[href$=/followers]";
    public static final String FOLLOWING_LINK = "a[href$=/following]";
    public static final String VERIFIED_ICON = "[data-testid=icon-verified]";

    // 포스트
    public static final String POST = "[data-testid=tweet]";
    public static final String POST_TEXT = "[data-testid=tweetText]";
    public static final String STATUS_LINK = "a[href*=/status/]";
    public static final String REPLY_BUTTON = "[data-testid=reply]";
    public static final String REPOST_BUTTON = "[data-testid=retweet], [data-testid=unretweet]";
    public static final String LIKE_BUTTON = "[data-testid=like], [data-testid=unlike]";
    public static final String VIEWS_LINK = "a[href*=/analytics]";
    public static final String TIME = "time[datetime]";
    public static final String MEDIA_IMG = "img[src*=pbs.twimg.com/media]";
    public static final String SOCIAL_CONTEXT = "[data-testid=socialContext]";
    public static final String QUOTE_CONTAINER = "[data-testid=quoteTweet]";
    public static final String CARD_WRAPPER = "[data-testid=card.wrapper]";
    public static final String USER_LINK = "a[href^=/][role=link]";

    // 텍스트 마커
    public static final String PINNED_MARKER = "Pinned";
    public static final String REPLYING_TO = "Replying to";
    public static final int PINNED_MAX_DEPTH = 20;
}
