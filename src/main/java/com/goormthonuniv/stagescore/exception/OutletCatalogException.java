package com.goormthonuniv.stagescore.exception;

/** 매체 카탈로그를 읽을 수 없거나 비어 있음. 시스템 수준 실패로 기동/배치를 중단한다. */
public class OutletCatalogException extends RuntimeException {

    public OutletCatalogException(String message) {
        super(message);
    }

    public OutletCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
