package io.b2mash.taskdesk.member;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the acting member into {@link MemberContext} and the logging MDC. Authentication happens
 * upstream; this filter only trusts the identity headers the gateway forwards.
 */
@Component
public class MemberFilter extends OncePerRequestFilter {

  public static final String MEMBER_ID_HEADER = "X-Member-Id";
  public static final String MEMBER_ROLE_HEADER = "X-Member-Role";

  private static final Logger log = LoggerFactory.getLogger(MemberFilter.class);

  private static final String MDC_MEMBER_ID = "memberId";
  private static final String MDC_REQUEST_ID = "requestId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      String memberId = request.getHeader(MEMBER_ID_HEADER);
      if (memberId != null && !memberId.isBlank()) {
        MemberContext.setCurrentMemberId(memberId.strip());
        MDC.put(MDC_MEMBER_ID, memberId.strip());

        String role = request.getHeader(MEMBER_ROLE_HEADER);
        if (role != null && !role.isBlank()) {
          MemberContext.setRole(role.strip().toLowerCase(Locale.ROOT));
        }
      } else {
        log.debug("No member identity on {} {}", request.getMethod(), request.getRequestURI());
      }

      filterChain.doFilter(request, response);
    } finally {
      MemberContext.clear();
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }
}
