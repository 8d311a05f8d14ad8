package com.example.cafeshift.payroll;

import com.example.cafeshift.common.RequestContext;
import com.example.cafeshift.employee.Employee;
import com.example.cafeshift.employee.EmployeeRepository;
import com.example.cafeshift.employee.EmployeeRole;
import com.example.cafeshift.shift.Shift;
import com.example.cafeshift.shift.TimeLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class PayrollControllerTest {

    private static final long BRANCH = 601L;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private EmployeeRepository employeeRepository;

    @Autowired
    private TimeLedgerService timeLedgerService;

    @Autowired
    private PayrollService payrollService;

    private Long managerId;
    private Long baristaId;

    @BeforeEach
    void setUp() {
        managerId = employeeRepository.save(new Employee("Lead", EmployeeRole.MANAGER, new BigDecimal("150.00"), BRANCH)).getId();
        baristaId = employeeRepository.save(new Employee("Barista", EmployeeRole.EMPLOYEE, new BigDecimal("125.00"), BRANCH)).getId();

        RequestContext manager = RequestContext.manager(managerId);
        LocalDate day = LocalDate.of(2025, 6, 2);
        for (int i = 0; i < 10; i++, day = day.plusDays(1)) {
            while (day.getDayOfWeek().getValue() > 5) {
                day = day.plusDays(1);
            }
            LocalDateTime start = day.atTime(9, 0);
            Shift shift = timeLedgerService.createShift(manager, baristaId, start, start.plusHours(8), "Barista");
            timeLedgerService.clockIn(manager, shift.getId(), start);
            timeLedgerService.clockOut(manager, shift.getId(), start.plusHours(8));
        }
    }

    @Test
    void createPeriodAndRun_returnsComputedEntries() throws Exception {
        String payload = """
            {
              "branchId": 601,
              "startDate": "2025-06-02",
              "endDate": "2025-06-15"
            }
            """;

        mockMvc.perform(post("/api/payroll/periods")
                .header("X-Actor-Id", managerId)
                .header("X-Actor-Role", "manager")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.status").value("OPEN"));

        Long periodId = payrollService.listPeriods(BRANCH).get(0).id();

        mockMvc.perform(post("/api/payroll/periods/" + periodId + "/run")
                .header("X-Actor-Id", managerId)
                .header("X-Actor-Role", "MANAGER"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.entries").value(1))
            .andExpect(jsonPath("$.meta.errors").value(0))
            .andExpect(jsonPath("$.data.entries[0].employeeId").value(baristaId))
            .andExpect(jsonPath("$.data.entries[0].amounts.grossPay").value(10000.0))
            .andExpect(jsonPath("$.data.entries[0].amounts.sssContribution").value(450.0))
            .andExpect(jsonPath("$.data.entries[0].amounts.netPay").value(9200.0));

        mockMvc.perform(get("/api/payroll/periods/" + periodId + "/entries/" + baristaId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("DRAFT"))
            .andExpect(jsonPath("$.data.amounts.totalDeductions").value(800.0));

        assertThat(payrollService.getPeriod(periodId).totalPay()).isEqualByComparingTo("10000.00");
    }

    @Test
    void run_withoutManagerRoleIsBadRequest() throws Exception {
        Long periodId = payrollService.createPeriod(RequestContext.manager(managerId), BRANCH,
                LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 15)).getId();

        mockMvc.perform(post("/api/payroll/periods/" + periodId + "/run")
                .header("X-Actor-Id", baristaId))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.meta.errorCode").value("FORBIDDEN_ROLE"));
    }

    @Test
    void run_withoutActorHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/payroll/periods/1/run"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.meta.errorCode").value("MISSING_ACTOR"));
    }

    @Test
    void entry_missingIsNotFound() throws Exception {
        mockMvc.perform(get("/api/payroll/periods/999999/entries/" + baristaId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void job_unknownIsNotFound() throws Exception {
        mockMvc.perform(get("/api/payroll/jobs/does-not-exist"))
            .andExpect(status().isNotFound());
    }
}
