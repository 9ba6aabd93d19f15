package com.example.checkin.service.access;

import com.example.checkin.entities.AppUser;
import com.example.checkin.enums.UserRole;
import com.example.checkin.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AppUserService implements UserDetailsService {

    private final AppUserRepository userRepo;
    private final BCryptPasswordEncoder passwordEncoder;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        return userRepo.findByUsername(username).orElseThrow(() -> new UsernameNotFoundException("Not found"));
    }

    @Transactional(readOnly = true)
    public AppUser findByUsernameSafe(String username) {
        return userRepo.findByUsername(username).orElse(null);
    }

    /**
     * Resolves the authenticated principal to the identity the engine works with.
     */
    public CallerIdentity identify(Authentication authentication) {
        if (authentication != null && authentication.getPrincipal() instanceof AppUser) {
            return CallerIdentity.of((AppUser) authentication.getPrincipal());
        }
        AppUser user = authentication == null ? null : findByUsernameSafe(authentication.getName());
        if (user == null) {
            throw new UsernameNotFoundException("Unknown caller");
        }
        return CallerIdentity.of(user);
    }

    /**
     * Creates the account if the username is free, otherwise returns the existing one.
     */
    @Transactional
    public AppUser createUserDirect(String username, String rawPassword, UserRole role, Long subjectId) {
        var existing = userRepo.findByUsername(username);
        if (existing.isPresent()) {
            return existing.get();
        }
        AppUser u = AppUser.builder()
                .username(username)
                .password(passwordEncoder.encode(rawPassword))
                .role(role)
                .subjectId(subjectId)
                .build();
        try {
            return userRepo.saveAndFlush(u);
        } catch (DataIntegrityViolationException ex) {
            throw new IllegalArgumentException("Username already exists: " + username, ex);
        }
    }
}
