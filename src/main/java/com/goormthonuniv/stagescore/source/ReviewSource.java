package com.goormthonuniv.stagescore.source;

import com.goormthonuniv.stagescore.dto.RawReview;
import com.goormthonuniv.stagescore.dto.ShowContext;

import java.util.List;

/** 원시 리뷰 공급자 (수집기/외부 export). 공급자 하나의 실패는 다른 공급자에 영향 없음 */
public interface ReviewSource {

    String name();

    List<RawReview> fetch(ShowContext show);
}
