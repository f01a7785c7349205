package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.SpokenLanguage;

import java.util.List;

public interface SpokenLanguageRepository {

    SpokenLanguage save(SpokenLanguage language);

    List<SpokenLanguage> findByUserId(String userId);
}
