package com.unmark.core.pipeline;

import com.unmark.core.inpaint.Region;
import com.unmark.core.match.Match;

/**
 * Итог обработки одного изображения. png заполнен только при DONE;
 * при NO_MATCH и FAILED исходное изображение не изменялось.
 */
public record RemovalResult(Status status, Match match, Region region, byte[] png, String message) {

    public enum Status { DONE, NO_MATCH, FAILED }

    static RemovalResult done(Match match, Region region, byte[] png) {
        return new RemovalResult(Status.DONE, match, region, png, "Done");
    }

    static RemovalResult noMatch(String message) {
        return new RemovalResult(Status.NO_MATCH, null, null, null, message);
    }

    static RemovalResult failed(String message) {
        return new RemovalResult(Status.FAILED, null, null, null, message);
    }

    public boolean isDone() {
        return status == Status.DONE;
    }
}
