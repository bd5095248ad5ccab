package com.goormthonuniv.stagescore.rating;

import com.goormthonuniv.stagescore.outlet.RatingFormat;

import java.util.OptionalInt;

/**
 * 평점 문자열 하나를 0~100 으로 환산하는 전략.
 * RatingParser 가 고정 순서로 돌리며 처음 성공한 전략이 이긴다.
 */
public interface RatingStrategy {

    RatingFormat format();

    /**
     * @param rating   원문 평점 (trim 됨, null 아님)
     * @param maxScale 리뷰/매체가 알려준 만점 (모르면 null)
     * @return 환산 점수, 이 전략의 포맷이 아니면 empty
     */
    OptionalInt parse(String rating, Integer maxScale);
}
