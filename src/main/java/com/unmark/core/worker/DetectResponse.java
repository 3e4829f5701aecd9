package com.unmark.core.worker;

import com.unmark.core.match.Match;

/**
 * Ответ worker'а: либо ok=true с match (null — метка не найдена) и scaleToFull,
 * либо ok=false с текстом ошибки.
 */
public record DetectResponse(String id, boolean ok, Match match, double scaleToFull, String error) {

    public static DetectResponse success(String id, Match match, double scaleToFull) {
        return new DetectResponse(id, true, match, scaleToFull, null);
    }

    public static DetectResponse failure(String id, String error) {
        return new DetectResponse(id, false, null, 0, error);
    }
}
