package com.casebrain.domain.housing.repository;

import com.casebrain.domain.housing.model.IndicatorPack;

import java.util.Optional;
import java.util.Set;

public interface IndicatorPackRegistry {

    Optional<IndicatorPack> findByPracticeArea(String practiceArea);

    Set<String> practiceAreas();
}
