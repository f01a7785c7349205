package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.UserProfile;

import java.util.Optional;

public interface UserRepository {

    UserProfile save(UserProfile user);

    Optional<UserProfile> findById(String id);

    boolean existsById(String id);
}
