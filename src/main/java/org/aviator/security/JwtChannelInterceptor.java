package org.aviator.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authentifie le CONNECT STOMP via JWT. Un CONNECT sans jeton valide est rejeté
 * (l'exception ferme la session) ; les trames suivantes reprennent l'utilisateur de la session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtChannelInterceptor implements ChannelInterceptor {
    private final JwtUtil jwtUtil;
    private final UserDetailsService userDetailsService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(message);
        acc.setLeaveMutable(true);

        if (StompCommand.CONNECT.equals(acc.getCommand())) {
            String token = extractToken(acc);
            if (token == null || !jwtUtil.validerToken(token)) {
                throw new IllegalArgumentException("Invalid or missing JWT token");
            }
            String email = jwtUtil.extraireSubject(token);
            UserDetails ud = userDetailsService.loadUserByUsername(email);
            Authentication auth = new UsernamePasswordAuthenticationToken(ud, null, ud.getAuthorities());
            acc.setUser(auth);
            SecurityContextHolder.getContext().setAuthentication(auth);
            log.debug("WebSocket CONNECT {} -> {}", acc.getSessionId(), email);
        } else {
            var user = acc.getUser();
            if (user instanceof Authentication a) {
                SecurityContextHolder.getContext().setAuthentication(a);
            } else {
                SecurityContextHolder.clearContext();
            }
        }
        return MessageBuilder.createMessage(message.getPayload(), acc.getMessageHeaders());
    }

    private String extractToken(StompHeaderAccessor acc) {
        List<String> auths = acc.getNativeHeader("Authorization");
        if (auths != null && !auths.isEmpty()) {
            String v = auths.get(0);
            if (v != null && v.startsWith("Bearer ")) return v.substring(7);
        }
        List<String> toks = acc.getNativeHeader("token");
        if (toks != null && !toks.isEmpty()) return toks.get(0);

        var attrs = acc.getSessionAttributes();
        if (attrs != null) {
            Object sessTok = attrs.get("token");
            if (sessTok instanceof String s && !s.isBlank()) return s;
        }
        return null;
    }
}
