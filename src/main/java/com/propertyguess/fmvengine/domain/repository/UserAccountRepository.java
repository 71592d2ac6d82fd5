package com.propertyguess.fmvengine.domain.repository;

import com.propertyguess.fmvengine.domain.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {
}
