package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "patients", uniqueConstraints = {
    @UniqueConstraint(name = "uk_patient_mobile", columnNames = "mobile_number")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient extends BaseEntity {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false)
    private int age;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Gender gender;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String address;

    @Column(name = "mobile_number", nullable = false, length = 15)
    private String mobileNumber;

    public enum Gender {
        MALE,
        FEMALE,
        OTHER
    }
}
