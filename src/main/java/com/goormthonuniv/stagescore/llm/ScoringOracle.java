package com.goormthonuniv.stagescore.llm;

public interface ScoringOracle {

    String name();

    /** API 키 미설정 등으로 호출 자체가 불가능하면 false */
    boolean isAvailable();

    /**
     * 리뷰 본문을 0~100 으로 채점.
     * 실패는 반드시 OracleResult.failure 또는 OracleException 으로 표현한다 (0 은 유효한 혹평 점수).
     */
    OracleResult score(String reviewText);
}
