package io.b2mash.taskdesk.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class MemberFilterTest {

  private final MemberFilter filter = new MemberFilter();

  @Test
  void bindsMemberForRequestAndClearsAfterwards() throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/recurring-tasks");
    request.addHeader(MemberFilter.MEMBER_ID_HEADER, " staff-1 ");
    request.addHeader(MemberFilter.MEMBER_ROLE_HEADER, "Manager");
    var seenMember = new AtomicReference<String>();
    var seenRole = new AtomicReference<String>();
    var seenMdc = new AtomicReference<String>();
    FilterChain chain =
        (req, res) -> {
          seenMember.set(MemberContext.requireMemberId());
          seenRole.set(MemberContext.getRole());
          seenMdc.set(MDC.get("memberId"));
        };

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(seenMember.get()).isEqualTo("staff-1");
    assertThat(seenRole.get()).isEqualTo("manager");
    assertThat(seenMdc.get()).isEqualTo("staff-1");
    assertThat(MemberContext.getCurrentMemberId()).isNull();
    assertThat(MDC.get("memberId")).isNull();
  }

  @Test
  void requestWithoutHeaderLeavesContextUnbound() throws Exception {
    var request = new MockHttpServletRequest("GET", "/api/recurring-tasks");
    FilterChain chain =
        (req, res) ->
            assertThatThrownBy(MemberContext::requireMemberId)
                .isInstanceOf(MemberContextNotBoundException.class);

    filter.doFilter(request, new MockHttpServletResponse(), chain);
  }
}
