package com.goormthonuniv.stagescore.store;

import java.util.Optional;
import java.util.Set;

public interface ReviewStore {

    Optional<ShowSnapshot> load(String showId);

    /** 리뷰/집계/감사를 한 번에 교체. 읽는 쪽은 교체 전 또는 후 상태만 본다 */
    void replace(ShowSnapshot snapshot);

    Set<String> showIds();
}
