package com.gt.lse.model;

public record OutcomeCounts(int correct, int partial, int incorrect) {

    public static final OutcomeCounts NONE = new OutcomeCounts(0, 0, 0);

    public OutcomeCounts plus(Outcome outcome) {
        return switch (outcome) {
            case Correct -> new OutcomeCounts(correct + 1, partial, incorrect);
            case Partial -> new OutcomeCounts(correct, partial + 1, incorrect);
            case Incorrect -> new OutcomeCounts(correct, partial, incorrect + 1);
        };
    }
}
