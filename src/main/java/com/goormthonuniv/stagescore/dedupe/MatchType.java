package com.goormthonuniv.stagescore.dedupe;

public enum MatchType {
    URL,                    // 정규화 URL 일치
    OUTLET_CRITIC,          // 같은 매체 + 같은 평론가(대소문자 무시)
    OUTLET_MISSING_CRITIC,  // 같은 매체 + 한쪽 이상 평론가 미상
    NONE
}
