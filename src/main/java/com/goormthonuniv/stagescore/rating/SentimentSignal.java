package com.goormthonuniv.stagescore.rating;

/** 키워드 가중치 합. Validator 의 극성 검사에도 쓰인다 */
public record SentimentSignal(double positive, double negative, double mixed) {

    public static final SentimentSignal NONE = new SentimentSignal(0, 0, 0);

    public double total() {
        return positive + negative + mixed;
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    public double positiveRatio() {
        return isEmpty() ? 0 : positive / total();
    }

    public double negativeRatio() {
        return isEmpty() ? 0 : negative / total();
    }

    public boolean stronglyPositive() {
        return positiveRatio() > 0.6 && negativeRatio() < 0.2;
    }

    public boolean stronglyNegative() {
        return negativeRatio() > 0.6 && positiveRatio() < 0.2;
    }
}
