package com.photonlab.backend.service;

import com.photonlab.backend.config.PhotonLabProperties;
import com.photonlab.backend.domain.Excitation;
import com.photonlab.backend.domain.SimulationConfig;
import com.photonlab.backend.domain.SweepConfig;
import com.photonlab.backend.domain.SweepParameter;
import com.photonlab.backend.domain.SweepParameterName;
import com.photonlab.backend.domain.ValidationError;
import com.photonlab.backend.domain.ValidationResult;
import com.photonlab.backend.domain.WavelengthRange;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Physical and numerical sanity checks. Every rule runs; nothing short-circuits.
 */
@Component
public class ConfigValidator {

    static final int MAX_WAVELENGTH_POINTS = 10_000;
    static final int MAX_BASIS = 100;
    public static final int DEFAULT_MAX_SIMULATIONS = 100_000;

    private final int maxSimulations;

    public ConfigValidator() {
        this(DEFAULT_MAX_SIMULATIONS);
    }

    @Autowired
    public ConfigValidator(PhotonLabProperties properties) {
        this(properties.getSweep().getMaxSimulations());
    }

    public ConfigValidator(int maxSimulations) {
        this.maxSimulations = maxSimulations;
    }

    public ValidationResult validate(SimulationConfig config) {
        return ValidationResult.of(collect(config));
    }

    /**
     * Base configuration (fields prefixed {@code base_config.}) plus the sweep ranges.
     */
    public ValidationResult validateSweep(SweepConfig sweep) {
        List<ValidationError> errors = new ArrayList<>();
        if (sweep == null) {
            errors.add(ValidationError.error("base_config", "Sweep request is required"));
            return ValidationResult.of(errors);
        }
        for (ValidationError e : collect(sweep.baseConfig())) {
            errors.add(e.prefixed("base_config."));
        }
        errors.addAll(collectSweepParameters(sweep.sweeps()));
        return ValidationResult.of(errors);
    }

    /**
     * Only the ranges; used by preview where the base config is informational.
     */
    public ValidationResult validateSweepParameters(List<SweepParameter> sweeps) {
        return ValidationResult.of(collectSweepParameters(sweeps));
    }

    private List<ValidationError> collect(SimulationConfig c) {
        List<ValidationError> errors = new ArrayList<>();
        if (c == null) {
            errors.add(ValidationError.error("config", "Configuration is required"));
            return errors;
        }

        // geometry
        if (c.latticeConstant() <= 0) {
            errors.add(ValidationError.error("lattice_constant", "Lattice constant must be greater than 0"));
        }
        if (c.radius() <= 0) {
            errors.add(ValidationError.error("radius", "Hole radius must be greater than 0"));
        }
        if (c.radius() >= c.latticeConstant() / 2) {
            errors.add(ValidationError.error("radius", "Hole radius must be less than half the lattice constant"));
        }
        if (c.thickness() <= 0) {
            errors.add(ValidationError.error("thickness", "PCS thickness must be greater than 0"));
        }
        if (c.glassThickness() < 0) {
            errors.add(ValidationError.error("glass_thickness", "Glass thickness cannot be negative"));
        }

        // materials
        if (c.nSilicon() < 1) {
            errors.add(ValidationError.error("n_silicon", "Refractive index must be at least 1"));
        }
        if (c.kSilicon() < 0) {
            errors.add(ValidationError.error("k_silicon", "Extinction coefficient cannot be negative"));
        }
        if (c.nGlass() < 1) {
            errors.add(ValidationError.error("n_glass", "Glass refractive index must be at least 1"));
        }
        if (c.numBasis() < 1) {
            errors.add(ValidationError.error("num_basis", "Number of Fourier basis terms must be at least 1"));
        }
        if (c.numBasis() > MAX_BASIS) {
            errors.add(ValidationError.error("num_basis", "Number of Fourier basis terms should not exceed " + MAX_BASIS));
        }

        checkExcitation(c.excitation(), errors);
        checkWavelength(c.wavelength(), errors);
        return errors;
    }

    private void checkExcitation(Excitation ex, List<ValidationError> errors) {
        if (ex == null) {
            errors.add(ValidationError.error("excitation", "Excitation settings are required"));
            return;
        }
        if (ex.theta() < 0 || ex.theta() > 90) {
            errors.add(ValidationError.error("excitation.theta", "Polar angle must be between 0° and 90°"));
        }
        if (ex.phi() < 0 || ex.phi() > 360) {
            errors.add(ValidationError.error("excitation.phi", "Azimuthal angle must be between 0° and 360°"));
        }
        if (ex.sAmplitude() < 0 || ex.sAmplitude() > 1) {
            errors.add(ValidationError.error("excitation.s_amplitude", "s-polarization amplitude must be between 0 and 1"));
        }
        if (ex.pAmplitude() < 0 || ex.pAmplitude() > 1) {
            errors.add(ValidationError.error("excitation.p_amplitude", "p-polarization amplitude must be between 0 and 1"));
        }
        if (ex.sAmplitude() == 0 && ex.pAmplitude() == 0) {
            errors.add(ValidationError.error("excitation.s_amplitude", "At least one polarization amplitude must be non-zero"));
        }
    }

    private void checkWavelength(WavelengthRange w, List<ValidationError> errors) {
        if (w == null) {
            errors.add(ValidationError.error("wavelength", "Wavelength range is required"));
            return;
        }
        if (w.start() <= 0) {
            errors.add(ValidationError.error("wavelength.start", "Start wavelength must be greater than 0"));
        }
        if (w.end() <= 0) {
            errors.add(ValidationError.error("wavelength.end", "End wavelength must be greater than 0"));
        }
        if (w.start() >= w.end()) {
            errors.add(ValidationError.error("wavelength.start", "Start wavelength must be less than end wavelength"));
        }
        if (w.step() <= 0) {
            errors.add(ValidationError.error("wavelength.step", "Wavelength step must be greater than 0"));
        }
        if (w.step() > w.end() - w.start()) {
            errors.add(ValidationError.error("wavelength.step", "Step size is larger than the wavelength range"));
        }
        if (w.step() > 0) {
            double points = Math.floor((w.end() - w.start()) / w.step()) + 1;
            if (points > MAX_WAVELENGTH_POINTS) {
                errors.add(ValidationError.warning("wavelength.step",
                        "This will compute " + (long) points + " points. Consider using a larger step."));
            }
        }
    }

    private List<ValidationError> collectSweepParameters(List<SweepParameter> sweeps) {
        List<ValidationError> errors = new ArrayList<>();
        if (sweeps == null) return errors;
        Set<SweepParameterName> seen = EnumSet.noneOf(SweepParameterName.class);
        for (int i = 0; i < sweeps.size(); i++) {
            SweepParameter s = sweeps.get(i);
            String prefix = "sweeps[" + i + "]";
            if (s == null) {
                errors.add(ValidationError.error(prefix, "Sweep parameter is required"));
                continue;
            }
            if (s.name() == null) {
                errors.add(ValidationError.error(prefix + ".name", "Sweep parameter name is required"));
            } else if (!seen.add(s.name())) {
                errors.add(ValidationError.error(prefix + ".name", "Parameter '" + s.name().wire() + "' is swept more than once"));
            }
            if (s.step() <= 0) {
                errors.add(ValidationError.error(prefix + ".step", "Sweep step must be greater than 0"));
            }
        }
        if (exceedsMaxSimulations(sweeps)) {
            errors.add(ValidationError.error("sweeps",
                    "Sweep would run more than " + maxSimulations + " simulations; use fewer points"));
        }
        return errors;
    }

    // stops multiplying as soon as the cap is passed, so the product cannot overflow
    private boolean exceedsMaxSimulations(List<SweepParameter> sweeps) {
        long total = 1;
        for (SweepParameter s : sweeps) {
            if (s == null) continue;
            total *= s.pointCount();
            if (total > maxSimulations) return true;
        }
        return false;
    }
}
