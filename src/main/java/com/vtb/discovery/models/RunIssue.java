package com.vtb.discovery.models;

import lombok.Value;

/**
 * Запись о нефатальной ошибке: вид, источник (модуль, правило, актив) и сообщение
 */
@Value
public class RunIssue {
    ErrorKind kind;
    String source;
    String message;

    public static RunIssue of(ErrorKind kind, String source, String message) {
        return new RunIssue(kind, source, message);
    }
}
