package works.arbor.values;

public record PhysicalProperties(
	float density,
	float friction,
	float elasticity,
	float frictionWeight,
	float elasticityWeight
) { }
