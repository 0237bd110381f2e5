package com.vtb.discovery.analysis;

import com.vtb.discovery.models.RunIssue;
import lombok.Value;

import java.util.List;

/**
 * Результат загрузки внешних данных: значение плюс записи об отклоненных элементах
 */
@Value
public class LoadResult<T> {
    T value;
    List<RunIssue> issues;
}
