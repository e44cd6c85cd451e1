package io.intellixity.jobly.server.web;

import io.intellixity.jobly.auth.Caller;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Resolves the {@link Caller} from identity headers set by the authenticating gateway.
 * <p>
 * No user header means anonymous; the admin claim counts only together with a user.
 */
@Component
public final class CallerFilter extends OncePerRequestFilter {
  private static final Logger log = LoggerFactory.getLogger(CallerFilter.class);

  public static final String USER_HEADER = "X-Jobly-User";
  public static final String ADMIN_HEADER = "X-Jobly-Admin";
  public static final String CALLER_ATTRIBUTE = CallerFilter.class.getName() + ".caller";

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    Caller caller = resolve(request.getHeader(USER_HEADER), request.getHeader(ADMIN_HEADER));
    request.setAttribute(CALLER_ATTRIBUTE, caller);
    log.debug("jobly.http caller role={} user={} {} {}", caller.role(), caller.identifier(),
        request.getMethod(), request.getRequestURI());
    filterChain.doFilter(request, response);
  }

  static Caller resolve(String userHeader, String adminHeader) {
    if (userHeader == null || userHeader.isBlank()) return Caller.anonymous();
    String user = userHeader.trim();
    boolean admin = adminHeader != null && Boolean.parseBoolean(adminHeader.trim());
    return admin ? Caller.admin(user) : Caller.authenticated(user);
  }

  /** Caller stored by this filter; anonymous when the filter did not run. */
  public static Caller callerOf(HttpServletRequest request) {
    Object c = request.getAttribute(CALLER_ATTRIBUTE);
    return (c instanceof Caller caller) ? caller : Caller.anonymous();
  }
}
